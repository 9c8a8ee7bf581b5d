package com.herzen.maxviews.log;

import java.util.Set;

public final class CrudKinds {
    public static final String CREATE = "c";
    public static final String READ = "r";
    public static final String UPDATE = "u";
    public static final String DELETE = "d";

    public static final Set<String> SUPPORTED = Set.of(CREATE, READ, UPDATE, DELETE);

    private CrudKinds() {}
}
