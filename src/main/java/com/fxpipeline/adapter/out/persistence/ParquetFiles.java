package com.fxpipeline.adapter.out.persistence;

import org.apache.parquet.example.data.Group;
import org.apache.parquet.example.data.simple.SimpleGroupFactory;
import org.apache.parquet.hadoop.ParquetFileWriter;
import org.apache.parquet.hadoop.ParquetReader;
import org.apache.parquet.hadoop.ParquetWriter;
import org.apache.parquet.hadoop.api.ReadSupport;
import org.apache.parquet.hadoop.example.ExampleParquetWriter;
import org.apache.parquet.hadoop.example.GroupReadSupport;
import org.apache.parquet.hadoop.metadata.CompressionCodecName;
import org.apache.parquet.io.InputFile;
import org.apache.parquet.io.LocalInputFile;
import org.apache.parquet.io.LocalOutputFile;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Blocking Parquet read and write of whole tables on the local file system.
 * Callers run these on a worker thread.
 */
public final class ParquetFiles {

    private ParquetFiles() {
    }

    public static <T> void write(Path path, ParquetTable<T> table, List<T> rows) throws IOException {
        SimpleGroupFactory factory = new SimpleGroupFactory(table.schema());
        try (ParquetWriter<Group> writer = ExampleParquetWriter.builder(new LocalOutputFile(path))
                .withType(table.schema())
                .withCompressionCodec(CompressionCodecName.SNAPPY)
                .withWriteMode(ParquetFileWriter.Mode.OVERWRITE)
                .build()) {
            for (T row : rows) {
                writer.write(table.toGroup(factory, row));
            }
        }
    }

    public static <T> List<T> read(Path path, ParquetTable<T> table) throws IOException {
        List<T> rows = new ArrayList<>();
        try (ParquetReader<Group> reader = new GroupReaderBuilder(new LocalInputFile(path)).build()) {
            Group group;
            while ((group = reader.read()) != null) {
                rows.add(table.fromGroup(group));
            }
        }
        return rows;
    }

    private static final class GroupReaderBuilder extends ParquetReader.Builder<Group> {

        private GroupReaderBuilder(InputFile file) {
            super(file);
        }

        @Override
        protected ReadSupport<Group> getReadSupport() {
            return new GroupReadSupport();
        }
    }
}
