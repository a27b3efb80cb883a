package personal.dine.seating.booking.domain.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import personal.dine.common.exception.BusinessException;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("TableCombination 단위 테스트")
class TableCombinationTest {

    private final DiningTable t2 = new DiningTable(5L, "2", 1, 2, true, null);
    private final DiningTable t10 = new DiningTable(3L, "10", 2, 4, true, null);
    private final DiningTable t9 = new DiningTable(9L, "9", 2, 4, true, null);
    private final DiningTable privateRoom = new DiningTable(7L, "P1", 4, 8, false, "room");

    @Test
    @DisplayName("합석 불가 테이블은 조합할 수 없음")
    void create_NonSharedCombined() {
        assertThatThrownBy(() -> new TableCombination(List.of(t2, privateRoom)))
                .isInstanceOf(BusinessException.class)
                .hasMessageContaining("Only shared tables can be combined");
    }

    @Test
    @DisplayName("조합 수용 인원은 합산")
    void capacitySums() {
        TableCombination combination = new TableCombination(List.of(t2, t10));

        assertThat(combination.totalMinCapacity()).isEqualTo(3);
        assertThat(combination.totalMaxCapacity()).isEqualTo(6);
        assertThat(combination.admits(5)).isTrue();
        assertThat(combination.admits(2)).isFalse();
        assertThat(combination.excessFor(5)).isEqualTo(1);
    }

    @Test
    @DisplayName("락 획득 순서는 테이블 ID 오름차순")
    void lockOrder() {
        TableCombination combination = new TableCombination(List.of(t9, t2, t10));

        assertThat(combination.lockOrder()).containsExactly(3L, 5L, 9L);
    }

    @Test
    @DisplayName("순위: 초과 인원 → 테이블 번호(숫자 비교)")
    void rankingFor() {
        List<TableCombination> candidates = new ArrayList<>(List.of(
                TableCombination.single(t10),
                TableCombination.single(t9),
                TableCombination.single(t2)));

        candidates.sort(TableCombination.rankingFor(2));

        assertThat(candidates).extracting(c -> c.tableNumbers().get(0)).containsExactly("2", "9", "10");
    }
}
