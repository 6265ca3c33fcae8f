package com.gnovoa.gridiron.playoffs;

import java.util.List;

/** Result of a completed postseason: participants are AFC seeds 1-7 then NFC seeds 1-7. */
public record PlayoffOutcome(String championId, String runnerUpId, List<String> participants) {}
