package personal.dine.seating.hours.application.port.in;

import personal.dine.seating.hours.domain.model.SpecialHours;
import personal.dine.seating.hours.domain.model.WeeklyHours;

/**
 * Manage Operating Hours UseCase (Input Port)
 * 영업 시간 관리 유스케이스 - 등록된 항목이 있으면 수정, 없으면 생성
 */
public interface ManageOperatingHoursUseCase {

    WeeklyHours setWeeklyHours(SetWeeklyHoursCommand command);

    SpecialHours setSpecialHours(SetSpecialHoursCommand command);

    /**
     * @throws personal.dine.seating.hours.domain.exception.SpecialHoursNotFoundException 존재하지 않을 때
     */
    void deleteSpecialHours(Long specialHoursId);
}
