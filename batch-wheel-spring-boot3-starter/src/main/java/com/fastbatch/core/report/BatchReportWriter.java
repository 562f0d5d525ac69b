package com.fastbatch.core.report;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * 报告输出为 JSON, 字段顺序固定, 不含时间戳, 同样的样本输出字节一致
 */
public class BatchReportWriter {

    private static final Logger log = LoggerFactory.getLogger(BatchReportWriter.class);

    private final ObjectMapper mapper;

    /** 使用推荐的默认配置构造 */
    public BatchReportWriter() {
        this(createDefaultMapper());
    }

    /** 允许外部传入自定义 ObjectMapper */
    public BatchReportWriter(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public String toJson(BatchReport report) {
        try {
            return mapper.writeValueAsString(report);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize batch report to JSON", e);
        }
    }

    public void write(BatchReport report, Path target) {
        try {
            Path parent = target.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.write(target, toJson(report).getBytes(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write batch report to " + target, e);
        }
        log.info("[Report] written to {}", target);
    }

    private static ObjectMapper createDefaultMapper() {
        return JsonMapper.builder()
                .enable(SerializationFeature.INDENT_OUTPUT)
                // BigDecimal 按原值输出, 不转科学计数
                .enable(JsonGenerator.Feature.WRITE_BIGDECIMAL_AS_PLAIN)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .build();
    }
}
