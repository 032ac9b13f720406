package com.vidnyan.cpg.domain.query;

import java.util.List;
import java.util.Map;

public record QueryResult(List<Map<String, Object>> data, QueryMetadata metadata) {

    public QueryResult {
        data = List.copyOf(data);
    }

    public int size() {
        return data.size();
    }
}
