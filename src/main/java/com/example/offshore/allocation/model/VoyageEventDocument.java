package com.example.offshore.allocation.model;

import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

@Getter
@Setter
@ToString
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "voyage_events")
public class VoyageEventDocument implements OperationalRecord {

    public static final String[] BACKUP_HEADERS = {
        "id", "vessel", "mission", "voyageNumber", "location", "parentEvent", "event", "remarks",
        "portType", "costDedicatedTo", "hours", "from", "to", "department", "lcNumber", "lcPercentage",
        "mappedLocation", "mappingStatus", "dataIntegrity", "finalHours", "eventDate"
    };

    @Id
    private String id;
    private String vessel;
    private String mission;
    private String voyageNumber;
    private String location;
    private String parentEvent;
    private String event;
    private String remarks;
    private String portType;
    private String costDedicatedTo;
    private Double hours;
    private String from;
    private String to;

    private String department;
    private String lcNumber;
    private Double lcPercentage;
    private String mappedLocation;
    private String mappingStatus;
    private String dataIntegrity;
    private Double finalHours;
    private Instant eventDate;
    private Integer allocationCount;
    private Instant backfilledAt;
    private String backfillError;

    @Override
    public RecordKind kind() {
        return RecordKind.VOYAGE_EVENT;
    }

    @Override
    public String[] toBackupRow() {
        return new String[] {
            id, vessel, mission, voyageNumber, location, parentEvent, event, remarks,
            portType, costDedicatedTo, text(hours), from, to, department, lcNumber, text(lcPercentage),
            mappedLocation, mappingStatus, dataIntegrity, text(finalHours), text(eventDate)
        };
    }

    private static String text(Object value) {
        return value == null ? null : value.toString();
    }
}
