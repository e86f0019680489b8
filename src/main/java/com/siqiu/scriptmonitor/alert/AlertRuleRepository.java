package com.siqiu.scriptmonitor.alert;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface AlertRuleRepository extends JpaRepository<AlertRule, Long> {

    List<AlertRule> findByScheduleIdAndEnabledTrue(Long scheduleId);
}
