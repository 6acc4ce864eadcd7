package com.example.dutyroster.roster;

public record DutyCountDto(String name, int dutyCount) {
}
