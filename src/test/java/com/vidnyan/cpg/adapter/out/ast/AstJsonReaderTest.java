package com.vidnyan.cpg.adapter.out.ast;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.cpg.domain.ast.AstKind;
import com.vidnyan.cpg.domain.ast.AstNode;
import com.vidnyan.cpg.domain.common.AnalysisException;
import com.vidnyan.cpg.domain.common.ErrorCode;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class AstJsonReaderTest {

    private final AstJsonReader reader = new AstJsonReader(new ObjectMapper());

    @Test
    void read_Fixture_ShouldBuildModuleTree() throws IOException {
        // Act
        AstNode module;
        try (InputStream in = getClass().getResourceAsStream("/fixtures/worker.json")) {
            module = reader.read(in, "unused.ex");
        }

        // Assert
        assertEquals(AstKind.MODULE, module.kind());
        assertEquals("MyApp.Worker", module.name());
        assertEquals(2, module.childrenOfKind(AstKind.FUNCTION).size());
        AstNode handleCall = module.childrenOfKind(AstKind.FUNCTION).get(1);
        assertEquals("handle_call/3", handleCall.signature());
        assertEquals(13, handleCall.location().endLine());
        assertEquals("lib/my_app/worker.ex", handleCall.location().filePath());
        assertEquals("def", handleCall.attributes().get("visibility"));
    }

    @Test
    void read_MissingIds_ShouldBeGeneratedUniquely(@TempDir Path dir) throws IOException {
        // Arrange
        Path file = dir.resolve("ast.json");
        Files.writeString(file, """
                {"kind": "BLOCK", "line": 1, "children": [
                  {"kind": "variable", "name": "x", "line": 2},
                  {"id": "fixed", "kind": "literal", "value": 1, "line": 3, "file": "other.ex"}
                ]}
                """);

        // Act
        AstNode block = reader.read(file);

        // Assert
        assertEquals(AstKind.BLOCK, block.kind());
        assertEquals("n1", block.id());
        assertEquals("n2", block.child(0).id());
        assertEquals("fixed", block.child(1).id());
        assertEquals(file.toString(), block.child(0).location().filePath());
        assertEquals("other.ex", block.child(1).location().filePath());
        assertEquals(2, block.child(0).location().endLine());
    }

    @Test
    void read_UnknownKind_ShouldRejectAst(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("bad.json");
        Files.writeString(file, "{\"kind\": \"spaceship\"}");

        AnalysisException error = assertThrows(AnalysisException.class, () -> reader.read(file));

        assertEquals(ErrorCode.INVALID_AST, error.getCode());
        assertTrue(error.getMessage().contains("spaceship"));
    }

    @Test
    void read_MalformedJsonOrMissingFile_ShouldRejectAst(@TempDir Path dir) throws IOException {
        Path malformed = dir.resolve("broken.json");
        Files.writeString(malformed, "{\"kind\": ");

        assertEquals(ErrorCode.INVALID_AST,
                assertThrows(AnalysisException.class, () -> reader.read(malformed)).getCode());
        assertEquals(ErrorCode.INVALID_AST,
                assertThrows(AnalysisException.class, () -> reader.read(dir.resolve("absent.json"))).getCode());
    }
}
