package org.pokerroom.model.poker;

public enum Street { WAITING, PREFLOP, FLOP, TURN, RIVER, SHOWDOWN }
