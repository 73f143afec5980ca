package org.irradcontrol.scan;

/**
 * A position of the stage; {@code x} is the horizontal, {@code y} the vertical axis.
 */
public record Point(double x, double y) {
}
