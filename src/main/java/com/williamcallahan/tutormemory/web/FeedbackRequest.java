package com.williamcallahan.tutormemory.web;

import com.williamcallahan.tutormemory.domain.memory.FactFeedbackType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * Body of a fact feedback call.
 */
public record FeedbackRequest(@NotBlank String userId, @NotNull FactFeedbackType feedback) {}
