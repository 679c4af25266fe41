package uk.gegc.questionbank.features.repair.application.source;

import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;
import uk.gegc.questionbank.features.aggregate.domain.model.IndexedRecord;
import uk.gegc.questionbank.features.repair.domain.model.RepairTable;
import uk.gegc.questionbank.features.userfact.domain.model.UserQuestionFact;
import uk.gegc.questionbank.features.userfact.domain.repository.UserQuestionFactRepository;

import java.util.List;
import java.util.UUID;

@Component
@RequiredArgsConstructor
public class UserFactRepairSource implements RepairSource {

    private final UserQuestionFactRepository factRepository;

    @Override
    public RepairTable supportedTable() {
        return RepairTable.USER_FACTS;
    }

    @Override
    public ScanPage scan(String cursor, int pageSize) {
        PageRequest page = PageRequest.of(0, pageSize);
        List<UserQuestionFact> rows = cursor == null
                ? factRepository.findAllByOrderByIdAsc(page)
                : factRepository.findByIdGreaterThanOrderByIdAsc(UUID.fromString(cursor), page);
        return toPage(rows, cursor, pageSize);
    }

    @Override
    public ScanPage scanUser(String userId, String cursor, int pageSize) {
        PageRequest page = PageRequest.of(0, pageSize);
        List<UserQuestionFact> rows = cursor == null
                ? factRepository.findByUserIdOrderByIdAsc(userId, page)
                : factRepository.findByUserIdAndIdGreaterThanOrderByIdAsc(userId, UUID.fromString(cursor), page);
        return toPage(rows, cursor, pageSize);
    }

    private static ScanPage toPage(List<UserQuestionFact> rows, String cursor, int pageSize) {
        List<IndexedRecord> records = rows.stream().map(UserQuestionFact::toIndexedRecord).toList();
        String next = rows.isEmpty() ? cursor : rows.get(rows.size() - 1).getId().toString();
        return new ScanPage(records, next, rows.size() < pageSize);
    }
}
