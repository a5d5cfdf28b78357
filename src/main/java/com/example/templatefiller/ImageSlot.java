package com.example.templatefiller;

import org.apache.poi.util.Units;

import java.util.Optional;

/** Image placeholders the templates know about, with the width each one is drawn at. */
public enum ImageSlot {
    IMAGE_SOURCES_USES(6.5),
    IMAGE_CAPITAL_STACK_CLOSING(6.5),
    IMAGE_LOAN_TO_COST(6.0),
    IMAGE_LTV_LTC(6.0),
    IMAGE_AERIAL_MAP(5.0),
    IMAGE_LOCATION_MAP(5.0),
    IMAGE_REGIONAL_MAP(5.0),
    IMAGE_SITE_PLAN(5.5),
    IMAGE_PILOT_SCHEDULE(6.0),
    IMAGE_TAKEOUT_SIZING(6.0);

    public static final String PREFIX = "IMAGE_";

    private final double widthInches;

    ImageSlot(double widthInches) {
        this.widthInches = widthInches;
    }

    public double widthInches() { return widthInches; }

    public long widthEmu() { return Units.toEMU(widthInches * 72); }

    /** Height in EMU keeping the native aspect ratio at this slot's width. */
    public long heightEmu(int nativeWidthPx, int nativeHeightPx) {
        if (nativeWidthPx <= 0 || nativeHeightPx <= 0) {
            throw new IllegalArgumentException("image dimensions must be positive: " + nativeWidthPx + "x" + nativeHeightPx);
        }
        return Math.round((double) widthEmu() * nativeHeightPx / nativeWidthPx);
    }

    public static Optional<ImageSlot> forToken(String name) {
        if (name == null || !name.startsWith(PREFIX)) return Optional.empty();
        for (ImageSlot s : values()) {
            if (s.name().equals(name)) return Optional.of(s);
        }
        return Optional.empty();
    }
}
