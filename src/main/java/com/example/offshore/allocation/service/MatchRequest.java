package com.example.offshore.allocation.service;

import com.example.offshore.allocation.model.OperationalRecord;
import com.example.offshore.allocation.model.RecordKind;
import com.example.offshore.allocation.model.VesselManifestDocument;
import com.example.offshore.allocation.model.VoyageEventDocument;

/**
 * The fields the matcher reads, lifted out of a record according to its kind. Manifest lines carry no
 * parent event, event or port type.
 */
public record MatchRequest(
        RecordKind kind,
        String recordId,
        String location,
        String chargeCode,
        String parentEvent,
        String event,
        String remarks,
        String portType) {

    public static MatchRequest from(OperationalRecord record) {
        return switch (record.kind()) {
            case VOYAGE_EVENT -> {
                VoyageEventDocument voyageEvent = (VoyageEventDocument) record;
                yield new MatchRequest(RecordKind.VOYAGE_EVENT, voyageEvent.getId(), voyageEvent.getLocation(),
                        voyageEvent.getCostDedicatedTo(), voyageEvent.getParentEvent(), voyageEvent.getEvent(),
                        voyageEvent.getRemarks(), voyageEvent.getPortType());
            }
            case MANIFEST_LINE -> {
                VesselManifestDocument manifest = (VesselManifestDocument) record;
                yield new MatchRequest(RecordKind.MANIFEST_LINE, manifest.getId(), manifest.getOffshoreLocation(),
                        manifest.getCostCode(), null, null, manifest.getRemarks(), null);
            }
        };
    }
}
