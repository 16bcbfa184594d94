package com.labelcheck.backend.services.labels.reconciliation;

import java.util.ArrayList;
import java.util.List;
import java.util.function.BiPredicate;

import com.labelcheck.backend.enums.MatchLevel;
import com.labelcheck.backend.services.labels.layout.LabelItem;
import com.labelcheck.backend.services.labels.util.NormalizeUtil;

import lombok.extern.slf4j.Slf4j;

/**
 * Pairs spreadsheet rows with extracted care labels and hang tags and compares their UPCs.
 *
 * Each row is matched with progressively looser keys: style+size+color, style+size, style+color, style.
 * Within a level the first item in list order wins.
 */
@Slf4j
public class ReconciliationService {

    private record MatchRule(MatchLevel level, BiPredicate<ExpectedRow, ItemKey> matches) {
    }

    private record ItemKey(LabelItem item, String style, String size, String color) {

        static ItemKey of(LabelItem item) {
            return new ItemKey(item,
                    NormalizeUtil.normalizeKey(item.styleNumber()),
                    NormalizeUtil.normalizeKey(item.size()),
                    NormalizeUtil.normalizeKey(item.color()));
        }
    }

    // Style equality is checked for every level before the rule itself.
    private static final List<MatchRule> RULES = List.of(
            new MatchRule(MatchLevel.STYLE_SIZE_COLOR,
                    (row, key) -> key.size().equals(row.size()) && key.color().equals(row.color())),
            new MatchRule(MatchLevel.STYLE_SIZE, (row, key) -> key.size().equals(row.size())),
            new MatchRule(MatchLevel.STYLE_COLOR, (row, key) -> key.color().equals(row.color())),
            new MatchRule(MatchLevel.STYLE, (row, key) -> true)
    );

    public ValidationReport reconcile(List<ExpectedRow> rows, List<LabelItem> careLabels, List<LabelItem> hangTags) {
        List<ItemKey> careKeys = keys(careLabels);
        List<ItemKey> hangKeys = keys(hangTags);

        List<MatchResult> results = new ArrayList<>();
        for (ExpectedRow row : rows) {
            results.add(new MatchResult(
                    row,
                    match(row, careKeys, row.careUpc()),
                    match(row, hangKeys, row.hangUpc())));
        }

        ValidationReport report = ValidationReport.of(results);
        log.info("[Reconcile] rows={} careLabels={} hangTags={} careLabelMatches={} hangTagMatches={}",
                rows.size(), careKeys.size(), hangKeys.size(),
                report.summary().careLabelMatches(), report.summary().hangTagMatches());
        return report;
    }

    private ItemMatch match(ExpectedRow row, List<ItemKey> candidates, String upcExpected) {
        if (row.style().isEmpty() || candidates.isEmpty()) {
            return ItemMatch.none(upcExpected);
        }

        for (MatchRule rule : RULES) {
            for (ItemKey key : candidates) {
                if (key.style().equals(row.style()) && rule.matches().test(row, key)) {
                    String upcActual = NormalizeUtil.digitsOnly(key.item().matchUpc());
                    boolean upcMatches = !upcExpected.isEmpty() && !upcActual.isEmpty() && upcExpected.equals(upcActual);
                    log.debug("[Reconcile] style={} level={} upcMatches={}", row.style(), rule.level().getLabel(), upcMatches);
                    return new ItemMatch(rule.level(), upcExpected, upcActual, upcMatches, key.item());
                }
            }
        }
        return ItemMatch.none(upcExpected);
    }

    private static List<ItemKey> keys(List<LabelItem> items) {
        if (items == null) return List.of();
        return items.stream().map(ItemKey::of).toList();
    }
}
