package personal.meet.scheduling.booking.domain.service;

import personal.meet.scheduling.booking.domain.model.TimeInterval;

import java.util.Collection;

/**
 * Conflict Checker
 * 시스템 전체에서 사용하는 유일한 구간 겹침 판정.
 * 슬롯 필터링, 슬롯 검증, 호스트 직접 예약, 일정 변경, 예약 요청 확정 모두 이 클래스를 사용한다.
 */
public final class ConflictChecker {

    private ConflictChecker() {
    }

    /**
     * [s1, e1)과 [s2, e2)는 s1 < e2 이고 s2 < e1 일 때만 겹친다.
     * 맞닿은 구간(e1 == s2)과 길이 0인 구간은 겹치지 않는다.
     */
    public static boolean overlaps(TimeInterval a, TimeInterval b) {
        if (a.isEmpty() || b.isEmpty()) {
            return false;
        }
        return a.start().isBefore(b.end()) && b.start().isBefore(a.end());
    }

    /**
     * 첫 번째 겹침에서 즉시 반환
     */
    public static boolean anyOverlap(TimeInterval candidate, Collection<TimeInterval> existing) {
        for (TimeInterval interval : existing) {
            if (overlaps(candidate, interval)) {
                return true;
            }
        }
        return false;
    }
}
