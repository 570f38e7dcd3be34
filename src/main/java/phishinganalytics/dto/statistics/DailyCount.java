package phishinganalytics.dto.statistics;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.time.LocalDate;

@Data
@AllArgsConstructor
public class DailyCount {
    private LocalDate date;
    private long count;
}
