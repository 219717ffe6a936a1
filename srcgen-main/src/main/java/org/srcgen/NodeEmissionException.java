package org.srcgen;

/**
 * A fatal condition met while emitting one node. Generation stops and no partial text is returned.
 */
public class NodeEmissionException extends SourceGenerationException {

    private final String nodeDescription;

    public NodeEmissionException(String message, String nodeDescription) {
        super(message);
        this.nodeDescription = nodeDescription;
    }

    public NodeEmissionException(String message, String nodeDescription, Throwable cause) {
        super(message, cause);
        this.nodeDescription = nodeDescription;
    }

    public String getNodeDescription() {
        return nodeDescription;
    }
}
