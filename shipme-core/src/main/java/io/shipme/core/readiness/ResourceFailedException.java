package io.shipme.core.readiness;

public final class ResourceFailedException extends RuntimeException {
    private final String resource;
    private final transient Object status;

    public ResourceFailedException(String resource, Object status) {
        super("Resource " + resource + " reached failure state " + status);
        this.resource = resource;
        this.status = status;
    }

    public String resource() {
        return resource;
    }

    public Object status() {
        return status;
    }
}
