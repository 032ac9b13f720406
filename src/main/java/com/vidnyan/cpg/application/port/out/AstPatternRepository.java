package com.vidnyan.cpg.application.port.out;

import com.vidnyan.cpg.domain.pattern.AstPatternTemplate;

import java.util.List;
import java.util.Optional;

/**
 * Port for loading named AST templates.
 */
public interface AstPatternRepository {

    List<AstPatternTemplate> findAll();

    Optional<AstPatternTemplate> findByName(String name);
}
