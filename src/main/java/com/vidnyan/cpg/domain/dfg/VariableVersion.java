package com.vidnyan.cpg.domain.dfg;

/**
 * One static-assignment instance of a source variable.
 */
public record VariableVersion(
    String name,
    int version,
    String scopeId,
    boolean parameter,
    boolean captured
) {

    public static String key(String name, int version) {
        return name + "_" + version;
    }

    /**
     * Identity of the version, e.g. {@code x_2}.
     */
    public String key() {
        return key(name, version);
    }
}
