package com.example.pawluxe_export.util;

public enum ClipKind {
    /** Every usable excerpt in the window, in time order. */
    FULL,
    /** A short reel assembled from the best excerpts of the window. */
    HIGHLIGHTS
}
