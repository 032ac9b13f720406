package com.vidnyan.cpg.domain.query;

public record OrderBy(String field, Direction direction) {

    public enum Direction { ASC, DESC }

    public static OrderBy asc(String field) {
        return new OrderBy(field, Direction.ASC);
    }

    public static OrderBy desc(String field) {
        return new OrderBy(field, Direction.DESC);
    }

    public String canonical() {
        return field + " " + (direction == null ? "?" : direction.name().toLowerCase());
    }
}
