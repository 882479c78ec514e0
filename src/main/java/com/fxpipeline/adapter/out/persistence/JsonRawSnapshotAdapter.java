package com.fxpipeline.adapter.out.persistence;

import com.fxpipeline.application.port.out.RawSnapshotRepository;
import com.fxpipeline.domain.error.PipelineException;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.file.CopyOptions;
import io.vertx.core.file.FileSystem;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.JsonObject;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.time.LocalDate;

/**
 * File persistence adapter for raw snapshots.
 * Layout: {basePath}/raw/YYYY-MM-DD.json, one pretty-printed document per date.
 */
@Slf4j
public class JsonRawSnapshotAdapter implements RawSnapshotRepository {

    static final String DIRECTORY = "raw";

    private final FileSystem fileSystem;
    private final Path directory;

    public JsonRawSnapshotAdapter(Vertx vertx, Path basePath) {
        this.fileSystem = vertx.fileSystem();
        this.directory = basePath.resolve(DIRECTORY);
    }

    @Override
    public Future<String> save(LocalDate date, JsonObject document) {
        String target = pathFor(date).toString();
        String temp = directory.resolve("." + date + ".json.tmp").toString();

        return fileSystem.mkdirs(directory.toString())
                .compose(v -> fileSystem.writeFile(temp, Buffer.buffer(document.encodePrettily())))
                .compose(v -> fileSystem.move(temp, target, new CopyOptions().setReplaceExisting(true)))
                .recover(error -> Future.failedFuture(
                        PipelineException.storageError("Failed to write raw snapshot " + target, error)))
                .map(v -> {
                    log.info("Saved raw snapshot to {}", target);
                    return target;
                });
    }

    @Override
    public Future<JsonObject> load(LocalDate date) {
        String path = pathFor(date).toString();

        return fileSystem.exists(path)
                .recover(error -> Future.failedFuture(
                        PipelineException.storageError("Failed to access raw snapshot " + path, error)))
                .compose(exists -> {
                    if (!exists) {
                        return Future.failedFuture(
                                PipelineException.snapshotNotFound("No raw snapshot found for " + date + " at " + path));
                    }
                    return fileSystem.readFile(path)
                            .recover(error -> Future.failedFuture(
                                    PipelineException.storageError("Failed to read raw snapshot " + path, error)))
                            .map(buffer -> decode(buffer, path));
                });
    }

    Path pathFor(LocalDate date) {
        return directory.resolve(date + ".json");
    }

    private static JsonObject decode(Buffer buffer, String path) {
        try {
            return buffer.toJsonObject();
        } catch (DecodeException | ClassCastException e) {
            throw PipelineException.inputError("Raw snapshot " + path + " is not a JSON object: " + e.getMessage());
        }
    }
}
