package uk.gegc.questionbank.features.repair.application.source;

import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;
import uk.gegc.questionbank.features.aggregate.domain.model.IndexedRecord;
import uk.gegc.questionbank.features.question.domain.model.Question;
import uk.gegc.questionbank.features.question.domain.repository.QuestionRepository;
import uk.gegc.questionbank.features.repair.domain.model.RepairTable;

import java.util.List;
import java.util.UUID;

@Component
@RequiredArgsConstructor
public class QuestionRepairSource implements RepairSource {

    private final QuestionRepository questionRepository;

    @Override
    public RepairTable supportedTable() {
        return RepairTable.QUESTIONS;
    }

    @Override
    public ScanPage scan(String cursor, int pageSize) {
        PageRequest page = PageRequest.of(0, pageSize);
        List<Question> rows = cursor == null
                ? questionRepository.findAllByOrderByIdAsc(page)
                : questionRepository.findByIdGreaterThanOrderByIdAsc(UUID.fromString(cursor), page);
        List<IndexedRecord> records = rows.stream().map(Question::toIndexedRecord).toList();
        String next = rows.isEmpty() ? cursor : rows.get(rows.size() - 1).getId().toString();
        return new ScanPage(records, next, rows.size() < pageSize);
    }
}
