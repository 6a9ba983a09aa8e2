package com.sandkev.ledgersync.fetch;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sandkev.ledgersync.normalize.RawTokenTransferLog;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Optional;

/**
 * Serves ERC-20 Transfer logs exported as {@code <dir>/<chain>/<address>.json}: a JSON array
 * of decoded logs ({@code transactionHash}, {@code logIndex}, {@code address}, {@code from},
 * {@code to}, {@code value}, {@code blockNumber}, {@code timeStamp}).
 */
@Slf4j
public class JsonExportTokenLogFetchers implements TokenLogFetchers {

    private final Path dir;
    private final ObjectMapper om;

    public JsonExportTokenLogFetchers(Path dir, ObjectMapper om) {
        this.dir = dir;
        this.om = om;
    }

    @Override
    public Optional<BatchFetcher<RawTokenTransferLog>> transferLogs(String chain, String address) {
        Path f = dir.resolve(chain.toLowerCase(Locale.ROOT)).resolve(address.toLowerCase(Locale.ROOT) + ".json");
        if (!Files.isRegularFile(f)) {
            log.debug("No transfer log export at {}", f);
            return Optional.empty();
        }
        return Optional.of(req -> JsonExportPages.page(om, f, req, RawRecordMapper::tokenTransferLog,
                RawTokenTransferLog::blockTimestamp, null));
    }
}
