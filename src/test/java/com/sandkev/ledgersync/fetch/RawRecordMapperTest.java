package com.sandkev.ledgersync.fetch;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sandkev.ledgersync.testsupport.ClasspathFixtures;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class RawRecordMapperTest {

    @Test
    @SuppressWarnings("unchecked")
    void mapsDebankHistoryEntry() throws Exception {
        Map<String, Object> body = new ObjectMapper().readValue(
                ClasspathFixtures.text("/debank/history_page2.json"), new TypeReference<>() {});
        var entry = ((List<Map<String, Object>>) body.get("history_list")).get(0);

        var tx = RawRecordMapper.onchainTx(entry, "eth");

        assertThat(tx.id()).isEqualTo("0xccc3");
        assertThat(tx.categoryHint()).isNull();
        assertThat(tx.sends()).hasSize(1);
        assertThat(tx.sends().get(0).amount()).isEqualByComparingTo("100");
        assertThat(tx.receives().get(0).tokenId()).isEqualTo("eth");
        assertThat(tx.fromAddr()).isEqualTo("0x1111111111111111111111111111111111111111");
        assertThat(tx.gasFee()).isEqualByComparingTo("0.002");
        assertThat(tx.approval()).isNull();
        assertThat(tx.scam()).isFalse();
    }

    @Test
    void mapsRpcStyleTransferLog() {
        var log = RawRecordMapper.tokenTransferLog(Map.of(
                "transactionHash", "0xabc",
                "logIndex", "0x1a",
                "address", "0xToken",
                "from", "0xa",
                "to", "0xb",
                "value", "0xde0b6b3a7640000",
                "blockNumber", "19000000",
                "timeStamp", "1710500000"));

        assertThat(log.logIndex()).isEqualTo(26);
        assertThat(log.value()).isEqualTo(new BigInteger("1000000000000000000"));
        assertThat(log.blockNumber()).isEqualTo(19_000_000L);
    }

    @Test
    void missingNestedObjectsBecomeNulls() {
        var trade = RawRecordMapper.exchangeTrade(Map.of("id", "1", "symbol", "BTC/USDT", "amount", "oops"));

        assertThat(trade.feeCurrency()).isNull();
        assertThat(trade.feeCost()).isNull();
        assertThat(trade.amount()).isNull();
        assertThat(trade.timestamp()).isNull();
    }
}
