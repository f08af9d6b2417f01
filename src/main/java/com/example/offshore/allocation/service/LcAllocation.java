package com.example.offshore.allocation.service;

public record LcAllocation(String lcNumber, double percentage) {
}
