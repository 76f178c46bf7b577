package com.ttennebkram.imagelab.processing;

import com.ttennebkram.imagelab.registry.OperationParams;
import com.ttennebkram.imagelab.registry.OperationSpec;

/**
 * One step of a processing chain: an operation and its resolved parameters.
 */
public final class AppliedOperation {

    private final OperationSpec spec;
    private final OperationParams params;

    public AppliedOperation(OperationSpec spec, OperationParams params) {
        this.spec = spec;
        this.params = params;
    }

    public OperationSpec getSpec() {
        return spec;
    }

    public OperationParams getParams() {
        return params;
    }

    @Override
    public boolean equals(Object obj) {
        if (!(obj instanceof AppliedOperation)) {
            return false;
        }
        AppliedOperation other = (AppliedOperation) obj;
        return spec.equals(other.spec) && params.equals(other.params);
    }

    @Override
    public int hashCode() {
        return 31 * spec.hashCode() + params.hashCode();
    }

    @Override
    public String toString() {
        return spec.getKey() + " " + params;
    }
}
