/**
 * Monitoring engine.
 *
 * <p>{@link io.shardguard.enforcer.ThermodynamicEnforcer} runs one background cycle:
 * ambient drift check, entropy pass, regularity pass, and overwrite of any shard
 * that fails a check. Cycle results surface as {@link io.shardguard.enforcer.CycleReport}
 * and cumulative counters as {@link io.shardguard.enforcer.EnforcerStats}.
 */
package io.shardguard.enforcer;
