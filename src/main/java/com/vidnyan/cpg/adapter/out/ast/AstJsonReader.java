package com.vidnyan.cpg.adapter.out.ast;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.cpg.domain.ast.AstKind;
import com.vidnyan.cpg.domain.ast.AstNode;
import com.vidnyan.cpg.domain.ast.SourceLocation;
import com.vidnyan.cpg.domain.common.AnalysisException;
import com.vidnyan.cpg.domain.common.ErrorCode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Reads syntax trees exported by the external parser as JSON:
 * {@code {kind, name, value, operator, line, column, end_line, end_column, file, children, attributes}}.
 * Nodes without an id get {@code n<counter>}; the file path is inherited from the parent.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AstJsonReader {

    private final ObjectMapper objectMapper;

    public AstNode read(Path path) {
        log.debug("Reading AST from {}", path);
        try (InputStream in = Files.newInputStream(path)) {
            return read(in, path.toString());
        } catch (IOException e) {
            throw new AnalysisException(ErrorCode.INVALID_AST, "Cannot read AST file " + path, e);
        }
    }

    public AstNode read(InputStream in, String defaultFile) {
        try {
            NodeDto dto = objectMapper.readValue(in, NodeDto.class);
            return toNode(dto, defaultFile);
        } catch (IOException e) {
            throw new AnalysisException(ErrorCode.INVALID_AST, "Malformed AST JSON: " + e.getMessage(), e);
        }
    }

    /**
     * Convert an already-deserialized node tree.
     */
    public AstNode toNode(NodeDto dto, String defaultFile) {
        return convert(dto, defaultFile != null ? defaultFile : "", new AtomicInteger());
    }

    private AstNode convert(NodeDto dto, String inheritedFile, AtomicInteger ids) {
        if (dto == null || dto.kind == null) {
            throw new AnalysisException(ErrorCode.INVALID_AST, "AST node without a kind");
        }
        AstKind kind;
        try {
            kind = AstKind.valueOf(dto.kind.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new AnalysisException(ErrorCode.INVALID_AST, "Unknown AST kind: " + dto.kind, e);
        }
        String file = dto.file != null ? dto.file : inheritedFile;
        String id = dto.id != null ? dto.id : "n" + ids.incrementAndGet();
        SourceLocation location = new SourceLocation(file, dto.line, dto.column,
                dto.endLine > 0 ? dto.endLine : dto.line, dto.endColumn);

        AstNode.Builder builder = AstNode.builder(id, kind)
                .location(location)
                .name(dto.name)
                .value(dto.value)
                .operator(dto.operator);
        if (dto.attributes != null) {
            dto.attributes.forEach(builder::attribute);
        }
        if (dto.children != null) {
            for (NodeDto child : dto.children) {
                builder.child(convert(child, file, ids));
            }
        }
        return builder.build();
    }

    // DTO class for JSON deserialization
    public static class NodeDto {
        public String id;
        public String kind;
        public String name;
        public Object value;
        public String operator;
        public String file;
        public int line;
        public int column;
        @JsonProperty("end_line")
        public int endLine;
        @JsonProperty("end_column")
        public int endColumn;
        public List<NodeDto> children;
        public Map<String, Object> attributes;
    }
}
