package org.operaton.trainload.model;

/**
 * Text fragment recognized on a screenshot.
 * The bounding box is normalized to 0-1 with the origin at the bottom-left corner,
 * so a larger y means higher on the screen.
 */
public record OcrTextElement(String text, double confidence, double x, double y, double width, double height) {

    public double centerX() {
        return x + width / 2;
    }

    public double centerY() {
        return y + height / 2;
    }
}
