package com.dishdash.restaurant.dto;

import jakarta.validation.constraints.NotNull;

public record ToggleRequest(@NotNull Boolean enabled) {
}
