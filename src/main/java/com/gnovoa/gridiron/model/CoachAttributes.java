package com.gnovoa.gridiron.model;

/** Coach ratings on a 1..99 scale. */
public record CoachAttributes(int development, int gameDayIq, int playCalling) {}
