package com.titanic.inference.model;

public interface ModelLoader {
    ModelHandle load(String key);
}
