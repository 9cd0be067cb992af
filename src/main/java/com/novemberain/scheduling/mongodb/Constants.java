package com.novemberain.scheduling.mongodb;

public interface Constants {

  String JOB_DATA = "jobData";
  String JOB_DATA_PLAIN = "jobDataPlain";
  String TRIGGER_NEXT_FIRE_TIME = "nextFireTime";
  String TRIGGER_PRIORITY = "priority";
  String TRIGGER_CALENDAR_NAME = "calendarName";
  String TRIGGER_JOB_ID = "jobId";
  String TRIGGER_STATE = "state";
  String TRIGGER_VERSION = "version";
  String LOCK_INSTANCE_ID = "instanceId";
  String LOCK_TIME = "time";

  String STATE_WAITING = "waiting";
  String STATE_ACQUIRED = "acquired";
  String STATE_COMPLETE = "complete";
  String STATE_PAUSED = "paused";
  String STATE_PAUSED_BLOCKED = "pausedBlocked";
  String STATE_BLOCKED = "blocked";
  String STATE_ERROR = "error";

}
