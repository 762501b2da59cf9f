package com.example.backupcore.orchestrator;

import com.example.backupcore.model.BackupRecords.BackupMetadata;
import com.example.backupcore.model.BackupSettings.RetentionPolicy;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.temporal.IsoFields;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Política de retenção em camadas, sem efeitos colaterais: recebe os backups de UM tipo de
 * storage e devolve quais manter. Mês = 30 dias; semanas e meses são chaves em UTC.
 */
public final class RetentionPolicyEvaluator {

    private static final Comparator<BackupMetadata> NEWEST_FIRST =
            Comparator.<BackupMetadata, Instant>comparing(BackupMetadata::startTime,
                            Comparator.nullsLast(Comparator.reverseOrder()))
                    .thenComparing(BackupMetadata::id);

    private RetentionPolicyEvaluator() {}

    public static final class Decision {
        private final List<BackupMetadata> keep;
        private final List<BackupMetadata> delete;
        private final int daily;
        private final int weekly;
        private final int monthly;

        Decision(List<BackupMetadata> keep, List<BackupMetadata> delete, int daily, int weekly, int monthly) {
            this.keep = List.copyOf(keep);
            this.delete = List.copyOf(delete);
            this.daily = daily;
            this.weekly = weekly;
            this.monthly = monthly;
        }

        /** Mantidos, do mais novo para o mais antigo. */
        public List<BackupMetadata> keep() { return keep; }
        public List<BackupMetadata> delete() { return delete; }
        public int dailyCount() { return daily; }
        public int weeklyCount() { return weekly; }
        public int monthlyCount() { return monthly; }
    }

    public static Decision evaluate(List<BackupMetadata> backups, RetentionPolicy policy, Instant now) {
        Objects.requireNonNull(policy, "policy");
        Objects.requireNonNull(now, "now");
        List<BackupMetadata> sorted = new ArrayList<>(backups);
        sorted.removeIf(b -> b.startTime() == null);
        sorted.sort(NEWEST_FIRST);

        Instant dailyCutoff = now.minus(Duration.ofDays(policy.dailyRetentionDays()));
        Instant weeklyCutoff = now.minus(Duration.ofDays(7L * policy.weeklyRetentionWeeks()));
        Instant monthlyCutoff = now.minus(Duration.ofDays(30L * policy.monthlyRetentionMonths()));

        Map<String, BackupMetadata> keep = new LinkedHashMap<>();
        int daily = 0;
        Set<String> weeksSeen = new HashSet<>();
        int weekly = 0;
        Set<String> monthsSeen = new HashSet<>();
        int monthly = 0;

        for (BackupMetadata b : sorted) {
            Instant t = b.startTime();
            if (!t.isBefore(dailyCutoff)) {
                keep.put(b.id(), b);
                daily++;
            } else if (!t.isBefore(weeklyCutoff)) {
                if (weeksSeen.add(weekKey(t))) {
                    keep.put(b.id(), b);
                    weekly++;
                }
            } else if (!t.isBefore(monthlyCutoff)) {
                if (monthsSeen.add(monthKey(t))) {
                    keep.put(b.id(), b);
                    monthly++;
                }
            }
        }

        List<BackupMetadata> kept = new ArrayList<>(keep.values());
        kept.sort(NEWEST_FIRST);
        int cap = Math.max(0, policy.maxBackups());
        if (kept.size() > cap) {
            kept = new ArrayList<>(kept.subList(0, cap));
        }
        Set<String> keptIds = new HashSet<>();
        for (BackupMetadata b : kept) keptIds.add(b.id());

        List<BackupMetadata> delete = new ArrayList<>();
        for (BackupMetadata b : backups) {
            if (!keptIds.contains(b.id())) delete.add(b);
        }
        return new Decision(kept, delete, daily, weekly, monthly);
    }

    static String weekKey(Instant instant) {
        ZonedDateTime t = instant.atZone(ZoneOffset.UTC);
        return t.get(IsoFields.WEEK_BASED_YEAR) + "-W" + t.get(IsoFields.WEEK_OF_WEEK_BASED_YEAR);
    }

    static String monthKey(Instant instant) {
        ZonedDateTime t = instant.atZone(ZoneOffset.UTC);
        return t.getYear() + "-" + t.getMonthValue();
    }
}
