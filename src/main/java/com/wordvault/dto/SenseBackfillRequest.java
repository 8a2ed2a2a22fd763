package com.wordvault.dto;

import jakarta.validation.constraints.NotEmpty;
import java.util.List;

public record SenseBackfillRequest(@NotEmpty List<SenseTranslationUpdate> updates) {}
