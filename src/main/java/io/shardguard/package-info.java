/**
 * ShardGuard source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.shardguard.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.shardguard.cli.ShardGuardCommand} maps commands to the enforcer and tooling.</li>
 *   <li>{@code io.shardguard.enforcer.ThermodynamicEnforcer} owns the monitoring loop and remediation.</li>
 *   <li>{@code io.shardguard.observability.AuditLogger} is the tamper-evident record of every decision.</li>
 * </ul>
 */
package io.shardguard;
