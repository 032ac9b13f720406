package com.vidnyan.cpg.domain.runtime;

public record AstMetadata(
        int complexity,
        String visibility,
        String filePath,
        int lineStart,
        int lineEnd
) {}
