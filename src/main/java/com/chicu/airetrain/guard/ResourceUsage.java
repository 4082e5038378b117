package com.chicu.airetrain.guard;

/**
 * Доли загрузки 0..1. Отрицательное значение: метрика недоступна на этой платформе.
 */
public record ResourceUsage(double cpu, double memory, double disk) {}
