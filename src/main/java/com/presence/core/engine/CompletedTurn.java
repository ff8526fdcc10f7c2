package com.presence.core.engine;

import com.presence.core.model.TrackingResult;

import java.util.concurrent.CompletableFuture;

/**
 * Result of completing a turn. Tracking and the memory write run detached; callers may
 * wait on, ignore or cancel either future without affecting the returned text.
 *
 * @param text           final text after mastery voice post-processing
 * @param masteryApplied whether the mastery voice shaped the text
 * @param tracking       pattern tracking outcome; completes exceptionally if tracking failed
 * @param storeWrite     memory store write; always completes normally with true on success
 */
public record CompletedTurn(
    String text,
    boolean masteryApplied,
    CompletableFuture<TrackingResult> tracking,
    CompletableFuture<Boolean> storeWrite
) {}
