package uk.gegc.questionbank.features.repair.application.source;

import org.springframework.stereotype.Component;
import uk.gegc.questionbank.features.repair.domain.model.RepairTable;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@Component
public class RepairSourceRegistry {

    private final Map<RepairTable, RepairSource> sources;

    public RepairSourceRegistry(List<RepairSource> sources) {
        this.sources = sources.stream().collect(Collectors.toMap(RepairSource::supportedTable, s -> s));
    }

    public RepairSource get(RepairTable table) {
        RepairSource source = sources.get(table);
        if (source == null) {
            throw new IllegalArgumentException("No repair source for table " + table);
        }
        return source;
    }
}
