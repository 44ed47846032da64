package de.bsommerfeld.swiftview.decoder;

public record Dimensions(int width, int height) {
}
