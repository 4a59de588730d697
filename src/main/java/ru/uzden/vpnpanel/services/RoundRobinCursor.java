package ru.uzden.vpnpanel.services;

import java.util.List;

/**
 * Курсор round-robin по локациям: атомарно выбирает следующую панель после последней выданной.
 */
public interface RoundRobinCursor {

    /**
     * @param candidateIds непустой список кандидатов в порядке выбора
     * @return id выбранной панели (уже сохранён как последний)
     */
    long advance(long locationId, List<Long> candidateIds);

    /**
     * Следующий после last с переходом в начало. Если last среди кандидатов нет - первый.
     */
    static long nextAfter(Long last, List<Long> candidateIds) {
        if (last != null) {
            int idx = candidateIds.indexOf(last);
            if (idx >= 0) {
                return candidateIds.get((idx + 1) % candidateIds.size());
            }
        }
        return candidateIds.get(0);
    }
}
