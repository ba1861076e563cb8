package com.ryuqq.reviewflow.application.export;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.ryuqq.reviewflow.core.catalogue.CatalogueEntry;
import com.ryuqq.reviewflow.core.chronicle.ChronicleRecord;
import com.ryuqq.reviewflow.core.model.EntryId;
import com.ryuqq.reviewflow.core.model.Position;
import com.ryuqq.reviewflow.core.model.ReviewVote;
import com.ryuqq.reviewflow.core.spi.CatalogueStore;
import com.ryuqq.reviewflow.core.spi.ChronicleStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * 카탈로그와 Chronicle을 JSON으로 내보냅니다.
 *
 * <p><strong>카탈로그:</strong> 항목별 전체 버전 체인</p>
 * <pre>
 * [{"id":"RULE-004","version":1,"status":"SUPERSEDED","content":"...","supersedes":null}, ...]
 * </pre>
 *
 * <p><strong>Chronicle:</strong> Phase 또는 시간 범위로 선택한 기록</p>
 * <pre>
 * [{"seq":1,"proposalId":"prop-...","before":"sha256:...","after":"sha256:...",
 *   "votes":[{"reviewer":"ARCHITECT","round":1,"verdict":"APPROVED","rationale":""}],
 *   "decision":"approved unanimously", ...}]
 * </pre>
 *
 * @author ReviewFlow Team
 * @since 1.0.0
 */
public class LedgerExporter {

    private static final Logger log = LoggerFactory.getLogger(LedgerExporter.class);

    private final CatalogueStore catalogue;
    private final ChronicleStore chronicle;
    private final ObjectMapper objectMapper;

    public LedgerExporter(CatalogueStore catalogue, ChronicleStore chronicle) {
        this(catalogue, chronicle, defaultMapper());
    }

    public LedgerExporter(CatalogueStore catalogue, ChronicleStore chronicle, ObjectMapper objectMapper) {
        if (catalogue == null || chronicle == null || objectMapper == null) {
            throw new IllegalArgumentException("catalogue, chronicle and objectMapper cannot be null");
        }
        this.catalogue = catalogue;
        this.chronicle = chronicle;
        this.objectMapper = objectMapper;
    }

    public static ObjectMapper defaultMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.setSerializationInclusion(JsonInclude.Include.ALWAYS);
        return mapper;
    }

    /**
     * 모든 항목의 버전 체인.
     */
    public String exportCatalogue() {
        List<CatalogueVersionView> versions = new ArrayList<>();
        for (CatalogueEntry current : catalogue.entries()) {
            for (CatalogueEntry version : catalogue.history(current.id())) {
                versions.add(CatalogueVersionView.from(version));
            }
        }
        return write(versions, "catalogue");
    }

    /**
     * 한 항목의 버전 체인.
     */
    public String exportCatalogue(EntryId id) {
        List<CatalogueVersionView> versions = catalogue.history(id).stream()
            .map(CatalogueVersionView::from)
            .toList();
        return write(versions, "catalogue entry " + id.getValue());
    }

    public String exportChronicle(int phase) {
        return writeRecords(chronicle.findByPhase(phase), "chronicle phase " + phase);
    }

    /**
     * {@code [from, to)} 범위에 기록된 Chronicle.
     */
    public String exportChronicle(Instant from, Instant to) {
        return writeRecords(chronicle.findBetween(from, to), "chronicle " + from + ".." + to);
    }

    private String writeRecords(List<ChronicleRecord> records, String what) {
        return write(records.stream().map(ChronicleRecordView::from).toList(), what);
    }

    private String write(Object value, String what) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            log.error("Failed to export {}", what, e);
            throw new LedgerExportException("Failed to export " + what, e);
        }
    }

    public record CatalogueVersionView(String id, int version, String status, String content, Integer supersedes,
                                       String note) {
        static CatalogueVersionView from(CatalogueEntry entry) {
            return new CatalogueVersionView(entry.id().getValue(), entry.version(), entry.status().name(),
                entry.content().getValue(), entry.supersedes(), entry.note());
        }
    }

    public record VoteView(String reviewer, int round, String verdict, String rationale) {
        static VoteView from(ReviewVote vote) {
            return new VoteView(vote.reviewer().name(), vote.round(), vote.verdict().name(), vote.rationale());
        }
    }

    public record PositionView(String role, int debateRound, String stance, String concern, String evidence,
                               String statement, Integer alternativeImpact) {
        static PositionView from(Position position) {
            return new PositionView(position.role().name(), position.debateRound(), position.stance().name(),
                position.concern().name(), position.evidence().toString(), position.statement(),
                position.alternative() == null ? null : position.alternativeImpact());
        }
    }

    public record ChronicleRecordView(long seq, String proposalId, String workItemId, int phase, String before,
                                      String after, List<String> requiredRoles, List<VoteView> votes,
                                      List<PositionView> debate, String decision, String basis,
                                      List<String> catalogueRefs, Instant recordedAt) {
        static ChronicleRecordView from(ChronicleRecord record) {
            return new ChronicleRecordView(
                record.sequence(),
                record.proposalId().getValue(),
                record.workItemId().getValue(),
                record.phase(),
                record.beforeRef(),
                record.afterRef(),
                record.requiredRoles().stream().map(Enum::name).toList(),
                record.votes().stream().map(VoteView::from).toList(),
                record.positions().stream().map(PositionView::from).toList(),
                record.decision(),
                record.basis().name(),
                record.catalogueRefs(),
                record.recordedAt());
        }
    }
}
