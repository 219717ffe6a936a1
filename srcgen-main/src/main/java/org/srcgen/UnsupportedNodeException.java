package org.srcgen;

public class UnsupportedNodeException extends NodeEmissionException {

    private final String nodeKind;
    private final int line;
    private final String backend;

    public UnsupportedNodeException(String nodeKind, int line, String backend) {
        super("No " + backend + " handler for node kind '" + nodeKind + "'" + (line > 0 ? " at line " + line : "")
              + " and no children to recurse into",
              nodeKind + (line > 0 ? "@" + line : ""));
        this.nodeKind = nodeKind;
        this.line = line;
        this.backend = backend;
    }

    public String getNodeKind() {
        return nodeKind;
    }

    public int getLine() {
        return line;
    }

    public String getBackend() {
        return backend;
    }
}
