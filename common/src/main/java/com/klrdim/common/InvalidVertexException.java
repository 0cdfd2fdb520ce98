package com.klrdim.common;

import java.util.Collection;

/** A color used in a sequence or weight is not a vertex of the quiver. */
public class InvalidVertexException extends KlrInputException {

    private final int vertex;

    public InvalidVertexException(String where, int vertex, Collection<Integer> indexSet) {
        super("vertex " + vertex + " in " + where + " is not in the index set " + indexSet);
        this.vertex = vertex;
    }

    public int getVertex() {
        return vertex;
    }
}
