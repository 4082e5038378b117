package com.chicu.airetrain.guard;

public interface ResourceProbe {

    ResourceUsage sample();
}
