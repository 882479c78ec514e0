package com.fxpipeline.application.port.out;

import io.vertx.core.Future;
import io.vertx.core.json.JsonObject;

import java.time.LocalDate;

/**
 * Output port for the raw layer: one snapshot document per date.
 */
public interface RawSnapshotRepository {

    /**
     * @return location of the stored document
     */
    Future<String> save(LocalDate date, JsonObject document);

    /**
     * Fails with a SNAPSHOT_NOT_FOUND pipeline error when nothing is stored for the date.
     */
    Future<JsonObject> load(LocalDate date);
}
