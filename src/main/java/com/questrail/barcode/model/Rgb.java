package com.questrail.barcode.model;

/**
 * One colour pixel; each channel is {@code 0..255}.
 */
public record Rgb(int red, int green, int blue)
{
    public static final Rgb BLACK = new Rgb(0, 0, 0);
    public static final Rgb WHITE = new Rgb(255, 255, 255);

    public Rgb {
        checkChannel("red", red);
        checkChannel("green", green);
        checkChannel("blue", blue);
    }

    private static void checkChannel(String name, int value)
    {
        if (value < 0 || value > 255) {
            throw new IllegalArgumentException(name + " must be 0-255: " + value);
        }
    }
}
