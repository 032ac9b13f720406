package com.vidnyan.cpg.adapter.out.pattern;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.cpg.adapter.out.ast.AstJsonReader;
import com.vidnyan.cpg.application.port.out.AstPatternRepository;
import com.vidnyan.cpg.config.EngineProperties;
import com.vidnyan.cpg.domain.pattern.AstPatternTemplate;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * AST pattern library loaded from JSON files on the classpath.
 * A file that cannot be read is skipped with a warning.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ClasspathAstPatternRepository implements AstPatternRepository {

    private final ObjectMapper objectMapper;
    private final AstJsonReader astJsonReader;
    private final EngineProperties properties;

    private final Map<String, AstPatternTemplate> templates = new ConcurrentHashMap<>();

    @PostConstruct
    public void loadPatterns() {
        String path = properties.getPattern().getLibraryPath();
        try {
            PathMatchingResourcePatternResolver resolver = new PathMatchingResourcePatternResolver();
            Resource[] resources = resolver.getResources(path);

            for (Resource resource : resources) {
                try (InputStream in = resource.getInputStream()) {
                    TemplateDto dto = objectMapper.readValue(in, TemplateDto.class);
                    AstPatternTemplate template = mapToTemplate(dto, resource.getFilename());
                    templates.put(template.name(), template);
                    log.info("Loaded AST pattern: {}", template.name());
                } catch (Exception e) {
                    log.warn("Failed to load AST pattern from {}: {}", resource.getFilename(), e.getMessage());
                }
            }

            log.info("Loaded {} AST patterns from {}", templates.size(), path);
        } catch (IOException e) {
            log.error("Failed to load AST patterns", e);
        }
    }

    @Override
    public List<AstPatternTemplate> findAll() {
        return templates.values().stream()
                .sorted(Comparator.comparing(AstPatternTemplate::name))
                .toList();
    }

    @Override
    public Optional<AstPatternTemplate> findByName(String name) {
        return Optional.ofNullable(name).map(templates::get);
    }

    private AstPatternTemplate mapToTemplate(TemplateDto dto, String filename) {
        if (dto.name == null || dto.name.isBlank()) {
            throw new IllegalArgumentException("pattern in " + filename + " has no name");
        }
        if (dto.template == null) {
            throw new IllegalArgumentException("pattern " + dto.name + " has no template");
        }
        return new AstPatternTemplate(
                dto.name,
                dto.description != null ? dto.description : "",
                astJsonReader.toNode(dto.template, ""),
                dto.matchVariables != null && dto.matchVariables);
    }

    // DTO class for JSON deserialization
    static class TemplateDto {
        public String name;
        public String description;
        public Boolean matchVariables;
        public AstJsonReader.NodeDto template;
    }
}
