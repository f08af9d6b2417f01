package com.example.offshore.allocation.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * One row of the cost-allocation ledger. Reference data: loaded per run, never written by the engine.
 */
@Getter
@ToString
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "cost_allocations")
public class LedgerEntry {

    @Id
    private String id;
    private String lcNumber;
    private String rigLocation;
    private String locationReference;
    private String projectType;
    private String department;
    private String rigReference;
    private Double allocatedDays;
    private String monthYear;
    private String description;
    private String costElement;
    private String mission;

    public ProjectType resolvedProjectType() {
        return ProjectType.fromLabel(projectType);
    }

    public Department resolvedDepartment() {
        return Department.fromLabel(department);
    }

    /**
     * Location text used for indexing: the rig location, else the free-text location reference.
     */
    public String locationText() {
        if (rigLocation != null && !rigLocation.isBlank()) {
            return rigLocation;
        }
        return locationReference;
    }
}
