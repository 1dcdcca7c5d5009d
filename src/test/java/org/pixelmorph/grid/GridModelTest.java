package org.pixelmorph.grid;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Grid Model Tests")
class GridModelTest {

    @Nested
    @DisplayName("1. RgbImage")
    class RgbImageTests {

        @Test
        @DisplayName("Packed and raw constructors agree")
        void testPackedMatchesRaw() {
            byte[] raw = {(byte) 255, 0, 16, 1, 2, 3};
            RgbImage fromRaw = RgbImage.of(2, 1, raw);
            RgbImage fromPacked = RgbImage.fromPacked(2, 1, new int[]{0xFF0010, 0x010203});

            assertEquals(fromRaw, fromPacked);
            assertEquals(fromRaw.hashCode(), fromPacked.hashCode());
            assertEquals(0xFF0010, fromRaw.packedAt(0));
            assertEquals(255, fromRaw.redAt(0));
            assertFalse(fromRaw.isSquare());
        }

        @Test
        @DisplayName("Buffer length must match dimensions")
        void testRejectsWrongLength() {
            assertThrows(IllegalArgumentException.class, () -> RgbImage.of(2, 2, new byte[11]));
            assertThrows(IllegalArgumentException.class, () -> RgbImage.of(0, 2, new byte[0]));
            assertThrows(IllegalArgumentException.class, () -> RgbImage.fromPacked(2, 2, new int[3]));
        }

        @Test
        @DisplayName("Image owns its buffer")
        void testDefensiveCopies() {
            byte[] raw = new byte[3];
            RgbImage image = RgbImage.of(1, 1, raw);
            raw[0] = 42;
            assertEquals(0, image.redAt(0), "mutating the input must not leak into the image");

            image.data()[0] = 7;
            assertEquals(0, image.redAt(0), "mutating data() must not leak into the image");
        }

        @Test
        @DisplayName("Out-of-range pixel index throws")
        void testPixelIndexBounds() {
            RgbImage image = RgbImage.fromPacked(1, 1, new int[]{0});
            assertThrows(IndexOutOfBoundsException.class, () -> image.packedAt(1));
        }
    }

    @Nested
    @DisplayName("2. PixelGrid")
    class PixelGridTests {

        @Test
        @DisplayName("Row-major coordinates")
        void testCoordinates() {
            PixelGrid grid = PixelGrid.ofPacked(3, new int[9]);

            assertEquals(3, grid.sideLength());
            assertEquals(9, grid.size());
            assertEquals(2, grid.x(5));
            assertEquals(1, grid.y(5));
            assertEquals(7, grid.index(1, 2));
        }

        @Test
        @DisplayName("Non-square raster is rejected")
        void testRejectsNonSquare() {
            RgbImage wide = RgbImage.fromPacked(2, 1, new int[2]);
            assertThrows(IllegalArgumentException.class, () -> PixelGrid.fromImage(wide));
        }

        @Test
        @DisplayName("Image round trip keeps colors")
        void testToImage() {
            RgbImage image = RgbImage.fromPacked(2, 2, new int[]{0x010203, 0x040506, 0x070809, 0x0A0B0C});
            PixelGrid grid = PixelGrid.fromImage(image);

            assertEquals(0x070809, grid.rgb(2));
            assertEquals(image, grid.toImage());
        }

        @Test
        @DisplayName("Alpha bits are masked off")
        void testMasksAlpha() {
            PixelGrid grid = PixelGrid.ofPacked(1, new int[]{0xFF123456});
            assertEquals(0x123456, grid.rgb(0));
        }
    }

    @Nested
    @DisplayName("3. WeightMap")
    class WeightMapTests {

        @Test
        @DisplayName("Weights come from the red channel")
        void testFromImage() {
            RgbImage importance = RgbImage.fromPacked(2, 1, new int[]{0x10FFFF, 0x800000});
            WeightMap weights = WeightMap.fromImage(importance);

            assertEquals(16L, weights.at(0));
            assertEquals(128L, weights.at(1));
        }

        @Test
        @DisplayName("Uniform default weight is 255")
        void testUniformDefault() {
            WeightMap weights = WeightMap.uniform(4);
            assertEquals(4, weights.size());
            assertEquals(WeightMap.DEFAULT_WEIGHT, weights.at(3));
            assertEquals(255L, WeightMap.DEFAULT_WEIGHT);
        }

        @Test
        @DisplayName("Negative weights are rejected")
        void testRejectsNegative() {
            assertThrows(IllegalArgumentException.class, () -> WeightMap.of(new long[]{1L, -1L}));
            assertThrows(IllegalArgumentException.class, () -> WeightMap.uniform(4, -5L));
            assertThrows(IllegalArgumentException.class, () -> WeightMap.uniform(0));
        }
    }
}
