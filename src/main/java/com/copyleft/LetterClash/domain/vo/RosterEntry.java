package com.copyleft.LetterClash.domain.vo;

import com.copyleft.LetterClash.domain.type.PlayerRole;

public record RosterEntry(PlayerRole role, String name) {}
