package com.visionai.gateway.database.config;

/**
 * Where one logical service keeps its data: a connection URI and the database name inside it.
 * Blank values are allowed at bind time and reported by {@link DatabaseProperties#requireComplete()}.
 */
public class DatabaseTarget {

    private String uri;

    private String name;

    public DatabaseTarget() {
    }

    public DatabaseTarget(String uri, String name) {
        this.uri = uri;
        this.name = name;
    }

    public boolean isComplete() {
        return uri != null && !uri.isBlank() && name != null && !name.isBlank();
    }

    public String getUri() { return uri; }
    public void setUri(String uri) { this.uri = uri; }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }
}
