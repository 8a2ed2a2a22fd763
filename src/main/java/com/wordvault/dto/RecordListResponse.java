package com.wordvault.dto;

import java.util.List;

public record RecordListResponse(long total, int page, int perPage, List<RecordSummary> data) {}
