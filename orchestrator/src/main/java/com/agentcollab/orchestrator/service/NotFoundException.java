package com.agentcollab.orchestrator.service;

/** An agent, team or execution id that the store does not know. */
public class NotFoundException extends RuntimeException {

    private final String kind;
    private final String id;

    public NotFoundException(String kind, String id) {
        super(kind + " not found: " + id);
        this.kind = kind;
        this.id   = id;
    }

    public String getKind() { return kind; }
    public String getId()   { return id; }
}
