package com.novemberain.quartz.store;

public interface Constants {

  String JOB_DATA = "jobData";
  String JOB_DATA_PLAIN = "jobDataPlain";
  String TRIGGER_NEXT_FIRE_TIME = "nextFireTime";
  String TRIGGER_JOB_NAME = "jobName";
  String TRIGGER_JOB_GROUP = "jobGroup";
  String TRIGGER_STATE = "state";
  String TRIGGER_PRIORITY = "priority";
  String TRIGGER_MISFIRE_INSTRUCTION = "misfireInstruction";
  String TRIGGER_CALENDAR_NAME = "calendarName";

  String STATE_WAITING = "waiting";
  String STATE_ACQUIRED = "acquired";
  String STATE_EXECUTING = "executing";
  String STATE_MISFIRED = "misfired";
  String STATE_DELETED = "deleted";
  String STATE_COMPLETE = "complete";
  String STATE_PAUSED = "paused";
  String STATE_PAUSED_BLOCKED = "pausedBlocked";
  String STATE_BLOCKED = "blocked";
  String STATE_ERROR = "error";

  String LOCK_TRIGGER_ACCESS = "TRIGGER_ACCESS";
  String LOCK_CALENDAR_ACCESS = "CALENDAR_ACCESS";
  String LOCK_STATE_ACCESS = "STATE_ACCESS";

  // Marker group name inserted by pauseAll().
  String ALL_GROUPS_PAUSED = "_$_ALL_GROUPS_PAUSED_$_";

}
