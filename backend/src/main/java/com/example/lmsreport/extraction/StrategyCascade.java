package com.example.lmsreport.extraction;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Function;

/**
 * 抽出戦略を優先順に試し、最初に空でない結果を返した戦略の結果だけを採用する。
 * 後続の戦略の結果とはマージしない。同一キー (URL) の候補は最初の1件のみ残す。
 */
public class StrategyCascade<I, C> {

    private static final Logger log = LoggerFactory.getLogger(StrategyCascade.class);

    private final String label;
    private final List<? extends ExtractionStrategy<I, C>> strategies;
    private final Function<C, String> keyExtractor;

    public StrategyCascade(String label, List<? extends ExtractionStrategy<I, C>> strategies,
                           Function<C, String> keyExtractor) {
        this.label = label;
        this.strategies = List.copyOf(strategies);
        this.keyExtractor = keyExtractor;
    }

    public CascadeResult<C> run(I input) {
        for (ExtractionStrategy<I, C> strategy : strategies) {
            List<C> candidates;
            try {
                candidates = strategy.extract(input);
            } catch (Exception e) {
                // 戦略単位で失敗を吸収し、次の戦略に進む
                log.warn("[{}] 戦略 {} で例外が発生しました。次の戦略を試します: {}", label, strategy.name(), e.toString());
                continue;
            }
            if (candidates != null && !candidates.isEmpty()) {
                List<C> unique = deduplicate(candidates);
                log.info("[{}] 戦略 {} で {}件を取得しました。", label, strategy.name(), unique.size());
                return new CascadeResult<>(strategy.name(), unique);
            }
            log.info("[{}] 戦略 {} は0件でした。", label, strategy.name());
        }
        return CascadeResult.empty();
    }

    public List<String> strategyNames() {
        return strategies.stream().map(ExtractionStrategy::name).toList();
    }

    private List<C> deduplicate(List<C> candidates) {
        Set<String> seen = new LinkedHashSet<>();
        List<C> unique = new ArrayList<>();
        for (C candidate : candidates) {
            String key = keyExtractor.apply(candidate);
            if (key == null || seen.add(key)) {
                unique.add(candidate);
            }
        }
        return unique;
    }

    /**
     * カスケードの結果。strategy は採用された戦略名 (何も取れなければ null)。
     */
    public record CascadeResult<C>(String strategy, List<C> items) {
        public static <C> CascadeResult<C> empty() {
            return new CascadeResult<>(null, List.of());
        }

        public boolean isEmpty() {
            return items.isEmpty();
        }
    }
}
