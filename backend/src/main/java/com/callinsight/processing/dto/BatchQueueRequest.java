package com.callinsight.processing.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;

import java.util.List;

public record BatchQueueRequest(
        @NotEmpty @Size(max = 1000) List<@Valid AddToQueueRequest> items
) {
}
