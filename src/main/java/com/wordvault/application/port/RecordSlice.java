package com.wordvault.application.port;

import com.wordvault.domain.LexicalRecord;
import java.util.List;

public record RecordSlice(long total, List<LexicalRecord> records) {}
