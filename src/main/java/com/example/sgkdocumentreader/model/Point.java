package com.example.sgkdocumentreader.model;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "Pixel coordinate")
public record Point(int x, int y) {

    public Point scale(double factor) {
        return new Point((int) Math.round(x * factor), (int) Math.round(y * factor));
    }
}
