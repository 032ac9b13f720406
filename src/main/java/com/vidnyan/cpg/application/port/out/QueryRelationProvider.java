package com.vidnyan.cpg.application.port.out;

import com.vidnyan.cpg.domain.query.Relation;

import java.util.List;
import java.util.Map;

/**
 * Port supplying the rows of a queryable relation.
 */
public interface QueryRelationProvider {

    /**
     * Current rows of the relation, one map of field name to value per function or module.
     */
    List<Map<String, Object>> rows(Relation relation);
}
