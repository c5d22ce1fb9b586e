package io.springsecurity.requestmap.admin.service;

import io.springsecurity.requestmap.entity.Requestmap;

import java.util.List;

public interface RequestmapService {
    Requestmap getRequestmap(long id);
    List<Requestmap> getRequestmaps();
    Requestmap createRequestmap(Requestmap requestmap);
    Requestmap updateRequestmap(Requestmap requestmap);
    void deleteRequestmap(long id);
}
