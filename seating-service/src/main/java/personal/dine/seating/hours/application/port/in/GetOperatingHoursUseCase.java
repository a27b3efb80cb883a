package personal.dine.seating.hours.application.port.in;

import personal.dine.seating.hours.domain.model.OperatingWindow;
import personal.dine.seating.hours.domain.model.SpecialHours;
import personal.dine.seating.hours.domain.model.WeeklyHours;

import java.time.LocalDate;
import java.util.List;

/**
 * Get Operating Hours UseCase (Input Port)
 * 영업 시간 조회 유스케이스
 */
public interface GetOperatingHoursUseCase {

    List<WeeklyHours> getWeeklyHours();

    /**
     * @param from null이면 시작 제한 없음
     * @param to   null이면 끝 제한 없음
     */
    List<SpecialHours> getSpecialHours(LocalDate from, LocalDate to);

    /**
     * @throws personal.dine.seating.hours.domain.exception.SpecialHoursNotFoundException 해당 날짜에 등록된 특별 영업 시간이 없을 때
     */
    SpecialHours getSpecialHours(LocalDate date);

    /**
     * 특정 날짜의 실제 영업 구간
     */
    OperatingWindow getEffectiveHours(LocalDate date);
}
