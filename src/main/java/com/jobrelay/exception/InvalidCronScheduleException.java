package com.jobrelay.exception;

public class InvalidCronScheduleException extends JobRelayException {

    private final String schedule;

    public InvalidCronScheduleException(String schedule, Throwable cause) {
        super("Invalid cron schedule '" + schedule + "'", cause);
        this.schedule = schedule;
    }

    public String getSchedule() {
        return schedule;
    }
}
