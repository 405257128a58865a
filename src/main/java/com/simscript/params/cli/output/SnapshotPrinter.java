package com.simscript.params.cli.output;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.simscript.params.record.OrderedRecord;
import com.simscript.params.record.RecordTable;
import com.simscript.params.value.ErrorMarker;

/**
 * Responsible only for printing CLI output. No validation, no evaluation.
 */
public class SnapshotPrinter {

    private static final Logger log = LoggerFactory.getLogger(SnapshotPrinter.class);

    public void printTable(Path source, OrderedRecord definitions, OrderedRecord snapshot) {
        log.info("=================================================");
        log.info("Definitions: {}", source.toAbsolutePath());
        log.info("=================================================");
        for (String line : RecordTable.render(definitions, snapshot).split("\n")) {
            log.info(line);
        }
        log.info("=================================================");
    }

    public void printErrors(OrderedRecord snapshot) {
        List<String> failed = failedFields(snapshot);
        if (failed.isEmpty()) {
            return;
        }
        log.warn("{} of {} definitions could not be evaluated:", failed.size(), snapshot.size());
        for (String name : failed) {
            log.warn("  {}: {}", name, snapshot.get(name));
        }
    }

    public void printText(String text) {
        for (String line : text.split("\n", -1)) {
            log.info(line);
        }
    }

    public void printWritten(Path output, String what) {
        log.info("{} written to {}", what, output.toAbsolutePath());
    }

    public static List<String> failedFields(OrderedRecord snapshot) {
        List<String> failed = new ArrayList<>();
        for (Map.Entry<String, Object> field : snapshot.items()) {
            if (field.getValue() instanceof ErrorMarker) {
                failed.add(field.getKey());
            }
        }
        return failed;
    }
}
