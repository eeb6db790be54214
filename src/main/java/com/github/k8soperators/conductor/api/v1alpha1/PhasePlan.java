package com.github.k8soperators.conductor.api.v1alpha1;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * Root of the phase plan file.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({ "phases" })
public class PhasePlan {

    List<PhaseSpec> phases;

    public List<PhaseSpec> getPhases() {
        return phases;
    }

    public void setPhases(List<PhaseSpec> phases) {
        this.phases = phases;
    }

}
