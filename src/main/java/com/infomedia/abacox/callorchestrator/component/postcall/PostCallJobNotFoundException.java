package com.infomedia.abacox.callorchestrator.component.postcall;

public class PostCallJobNotFoundException extends RuntimeException {
    public PostCallJobNotFoundException(Long id) {
        super("Post-call job " + id + " not found");
    }
}
