package com.trade.scalper.execution;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;

/**
 * CSV 交易日志，每笔平仓追加一行，时间为 UTC
 */
public class CsvTradeJournal implements TradeJournal {

    private static final Logger logger = LoggerFactory.getLogger(CsvTradeJournal.class);

    static final String HEADER = "日期,时间,交易对,方向,原因,价格,数量,投入金额,盈亏,余额\n";

    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd");
    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("HH:mm:ss");

    private final Path path;

    public CsvTradeJournal(Path path) {
        this.path = path;
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            if (!Files.exists(path)) {
                Files.writeString(path, HEADER, StandardCharsets.UTF_8, StandardOpenOption.CREATE_NEW);
            }
        } catch (IOException e) {
            logger.error("创建交易日志文件失败: {}", path, e);
        }
    }

    public Path getPath() {
        return path;
    }

    @Override
    public synchronized void record(TradeRecord record) {
        ZonedDateTime time = record.timestamp().atZone(ZoneOffset.UTC);
        String line = String.join(",",
                time.format(DATE_FORMAT),
                time.format(TIME_FORMAT),
                record.symbol().toString(),
                record.side().name(),
                record.reason(),
                record.price().toPlainString(),
                record.quantity().toPlainString(),
                money(record.investment()),
                money(record.pnl()),
                money(record.balance())) + "\n";
        try {
            Files.writeString(path, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } catch (IOException e) {
            logger.error("写入交易日志失败: {} -> {}", path, line.trim(), e);
        }
    }

    private static String money(BigDecimal value) {
        return value == null ? "" : value.setScale(2, RoundingMode.HALF_UP).toPlainString();
    }
}
