package com.sandkev.ledgersync.partition;

import com.sandkev.ledgersync.domain.Domain;
import com.sandkev.ledgersync.domain.EntityKind;

import java.nio.file.Path;
import java.time.YearMonth;

/** One month of one entity for one source. */
public record PartitionKey(Domain domain, String source, EntityKind entity, YearMonth period) {

    public String fileName() {
        return "%s_%04d-%02d.csv".formatted(entity.code(), period.getYear(), period.getMonthValue());
    }

    /** {@code <root>/<domain>/<source>/<entity>_<yyyy>-<mm>.csv} */
    public Path resolve(Path root) {
        return root.resolve(domain.code()).resolve(source).resolve(fileName());
    }

    @Override
    public String toString() {
        return domain.code() + "/" + source + "/" + fileName();
    }
}
