package de.bsommerfeld.swiftview.core.domain;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CacheKeyTest {

    @Test
    void equals_shouldRequireAllFieldsToMatch() {
        var a = CacheKey.thumbnail("/p/a.png", TargetSize.of(256, 195));
        var b = CacheKey.thumbnail("/p/a.png", TargetSize.of(256, 195));
        var otherSize = CacheKey.thumbnail("/p/a.png", TargetSize.of(128, 96));

        assertEquals(a, b);
        assertNotEquals(a, otherSize);
    }

    @Test
    void fullKey_shouldNeverEqualThumbnailKey() {
        var full = CacheKey.full("/p/a.png", TargetSize.of(256, 195));
        var thumb = CacheKey.thumbnail("/p/a.png", TargetSize.of(256, 195));

        assertNotEquals(full, thumb);
        assertNotEquals(full.identity(), thumb.identity());
    }

    @Test
    void identity_shouldIgnoreTargetSize() {
        var small = CacheKey.thumbnail("/p/a.png", TargetSize.of(64, 64));
        var large = CacheKey.thumbnail("/p/a.png", TargetSize.of(512, 512));

        assertEquals(small.identity(), large.identity());
    }

    @Test
    void full_withUnboundedTarget_shouldHaveNoTargetSize() {
        var key = CacheKey.full("/p/a.png", TargetSize.of(0, 0));
        assertNull(key.targetSize());
        assertEquals(CacheKey.full("/p/a.png"), key);
    }

    @Test
    void targetSize_shouldTreatMissingAxisAsUnconstrained() {
        var key = CacheKey.thumbnail("/p/a.png", TargetSize.width(300));

        assertEquals(300, key.targetWidth());
        assertNull(key.targetHeight());
        assertEquals(TargetSize.of(300, 0), key.targetSize());
    }

    @Test
    void targetSize_shouldRejectNegativeDimensions() {
        assertThrows(IllegalArgumentException.class, () -> TargetSize.of(-1, 10));
    }
}
