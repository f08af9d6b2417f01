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
@Document(collection = "vessel_manifests")
public class VesselManifestDocument implements OperationalRecord {

    public static final String[] BACKUP_HEADERS = {
        "id", "transporter", "manifestNumber", "voyageId", "offshoreLocation", "costCode", "remarks",
        "deckTons", "rtTons", "lifts", "wetBulkBbls", "department", "lcNumber", "lcPercentage",
        "mappedLocation", "mappingStatus", "dataIntegrity"
    };

    @Id
    private String id;
    private String transporter;
    private String manifestNumber;
    private String voyageId;
    private String offshoreLocation;
    private String costCode;
    private String remarks;
    private Double deckTons;
    private Double rtTons;
    private Integer lifts;
    private Double wetBulkBbls;

    private String department;
    private String lcNumber;
    private Double lcPercentage;
    private String mappedLocation;
    private String mappingStatus;
    private String dataIntegrity;
    private Integer allocationCount;
    private Instant backfilledAt;
    private String backfillError;

    @Override
    public RecordKind kind() {
        return RecordKind.MANIFEST_LINE;
    }

    @Override
    public String[] toBackupRow() {
        return new String[] {
            id, transporter, manifestNumber, voyageId, offshoreLocation, costCode, remarks,
            text(deckTons), text(rtTons), text(lifts), text(wetBulkBbls), department, lcNumber, text(lcPercentage),
            mappedLocation, mappingStatus, dataIntegrity
        };
    }

    private static String text(Object value) {
        return value == null ? null : value.toString();
    }
}
