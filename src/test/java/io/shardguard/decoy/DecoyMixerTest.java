package io.shardguard.decoy;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

final class DecoyMixerTest {

    @Test
    void mixIsDeterministicAndDetectable() {
        byte[] payload = new byte[1000];
        Arrays.fill(payload, (byte) 0x41);
        Assertions.assertFalse(DecoyMixer.containsDecoy(payload));

        DecoyMixer mixer = new DecoyMixer();
        byte[] mixed = mixer.mix(payload);
        Assertions.assertArrayEquals(mixed, mixer.mix(payload));
        Assertions.assertTrue(DecoyMixer.containsDecoy(mixed));
        Assertions.assertEquals(payload.length + 5 + 100, mixed.length);
    }

    @Test
    void primeBasedLevelsEmitQuarterSizedChunks() {
        byte[] payload = new byte[1000];
        Arrays.fill(payload, (byte) 0x41);
        Assertions.assertEquals(1000 + 5 + 25, new DecoyMixer(0.1, 1).mix(payload).length);
        Assertions.assertEquals(1000 + 5 + 25, new DecoyMixer(0.1, 2).mix(payload).length);
        Assertions.assertEquals(1000 + 5 + 100, new DecoyMixer(0.1, 5).mix(payload).length);
    }

    @Test
    void complexityIsClampedAndRatioValidated() {
        Assertions.assertEquals(5, new DecoyMixer(0.1, 9).complexity());
        Assertions.assertEquals(1, new DecoyMixer(0.1, -3).complexity());
        Assertions.assertThrows(IllegalArgumentException.class, () -> new DecoyMixer(1.5, 3));
        Assertions.assertEquals(5, new DecoyMixer(0.0, 3).mix(new byte[0]).length);
    }

    @Test
    void seedUsesFirstDigestBytesUnsigned() {
        long seed = DecoyMixer.seedOf(new byte[]{1, 2, 3});
        Assertions.assertTrue(seed >= 0L && seed <= 0xFFFFFFFFL);
        Assertions.assertEquals(seed, DecoyMixer.seedOf(new byte[]{1, 2, 3}));
    }
}
