package com.settleworks.core.persistence;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.settleworks.core.common.error.IncompatibleSchemaException;
import com.settleworks.core.common.error.MalformedSnapshotException;

/**
 * JSON form of {@link SettlementSnapshot}. Only the current schema version is accepted.
 */
public final class SnapshotCodec {

    public static final int SCHEMA_VERSION = 1;

    private final Gson gson = new GsonBuilder()
            .serializeSpecialFloatingPointValues()
            .setPrettyPrinting()
            .create();

    public String toJson(SettlementSnapshot snapshot) {
        if (snapshot.schemaVersion() != SCHEMA_VERSION) {
            throw new IncompatibleSchemaException(snapshot.schemaVersion(), SCHEMA_VERSION);
        }
        return gson.toJson(snapshot);
    }

    /**
     * @throws IncompatibleSchemaException when the document carries another schema version
     * @throws MalformedSnapshotException when the document is not a complete snapshot
     */
    public SettlementSnapshot fromJson(String json) {
        if (json == null || json.isBlank()) throw new MalformedSnapshotException("Empty snapshot");

        JsonObject root;
        try {
            JsonElement el = JsonParser.parseString(json);
            if (!el.isJsonObject()) throw new MalformedSnapshotException("Snapshot is not a JSON object");
            root = el.getAsJsonObject();
        } catch (JsonParseException e) {
            throw new MalformedSnapshotException("Snapshot is not valid JSON", e);
        }

        JsonElement version = root.get("schemaVersion");
        if (version == null || !version.isJsonPrimitive() || !version.getAsJsonPrimitive().isNumber()) {
            throw new MalformedSnapshotException("Snapshot has no numeric schemaVersion");
        }
        int found = version.getAsInt();
        if (found != SCHEMA_VERSION) {
            throw new IncompatibleSchemaException(found, SCHEMA_VERSION);
        }

        SettlementSnapshot snapshot;
        try {
            snapshot = gson.fromJson(root, SettlementSnapshot.class);
        } catch (JsonParseException | IllegalArgumentException e) {
            throw new MalformedSnapshotException("Snapshot fields do not match schema " + SCHEMA_VERSION, e);
        }
        requireComplete(snapshot);
        return snapshot;
    }

    private static void requireComplete(SettlementSnapshot s) {
        if (s.tier() == null) throw new MalformedSnapshotException("Snapshot has no tier");
        if (s.structures() == null) throw new MalformedSnapshotException("Snapshot has no structures");
        if (s.ledger() == null || s.ledger().amounts() == null) throw new MalformedSnapshotException("Snapshot has no ledger");
        if (s.settlers() == null) throw new MalformedSnapshotException("Snapshot has no settlers");
        for (SettlementSnapshot.StructureRecord r : s.structures()) {
            if (r == null || r.id() == null || r.typeId() == null || r.status() == null) {
                throw new MalformedSnapshotException("Structure record without id, type or status");
            }
        }
        for (SettlementSnapshot.SettlerRecord r : s.settlers()) {
            if (r == null || r.id() == null) throw new MalformedSnapshotException("Settler record without id");
        }
    }
}
