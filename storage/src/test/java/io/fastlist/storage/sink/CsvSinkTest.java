// file: storage/src/test/java/io/fastlist/storage/sink/CsvSinkTest.java
package io.fastlist.storage.sink;

import io.fastlist.core.Direction;
import io.fastlist.core.ObjectRecord;
import io.fastlist.core.diff.DiffEntry;
import io.fastlist.core.diff.DiffKind;
import org.junit.jupiter.api.Test;

import java.io.StringWriter;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class CsvSinkTest {

    @Test
    void object_rows_have_header_and_one_line_per_record() {
        StringWriter out = new StringWriter();
        try (CsvSink<ObjectRecord> sink = CsvSink.objects(out)) {
            sink.write(new ObjectRecord("a/1.txt", 12, "abc", Instant.parse("2024-01-02T03:04:05Z"), "STANDARD", Direction.LEFT));
            sink.write(new ObjectRecord("a/2,with,commas.txt", 0, null, null, null, Direction.LEFT));
            assertEquals(2, sink.written());
        }

        String[] lines = out.toString().split("\n");
        assertEquals(3, lines.length);
        assertEquals("key,size,etag,last_modified,storage_class,direction", lines[0]);
        assertEquals("a/1.txt,12,abc,2024-01-02T03:04:05Z,STANDARD,left", lines[1]);
        assertTrue(lines[2].startsWith("\"a/2,with,commas.txt\",0,"), "keys with commas are quoted");
    }

    @Test
    void diff_rows_leave_missing_side_empty() {
        StringWriter out = new StringWriter();
        try (CsvSink<DiffEntry> sink = CsvSink.diff(out)) {
            ObjectRecord left = new ObjectRecord("k", 5, "e1", null, null, Direction.LEFT);
            sink.write(new DiffEntry(DiffKind.LEFT_ONLY, "k", left, null));
        }

        String[] lines = out.toString().split("\n");
        assertEquals("kind,key,left_size,left_etag,left_last_modified,right_size,right_etag,right_last_modified", lines[0]);
        assertEquals("left_only,k,5,e1,,,,", lines[1]);
    }
}
