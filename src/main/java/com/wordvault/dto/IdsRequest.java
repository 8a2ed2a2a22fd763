package com.wordvault.dto;

import jakarta.validation.constraints.NotEmpty;
import java.util.List;

public record IdsRequest(@NotEmpty List<String> ids) {}
