package com.acme.homelander.traits;

import com.acme.homelander.error.CapabilityException;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/** Devices that can install, search for and open applications, such as TVs. */
public interface AppSelector {

  record ApplicationName(@JsonProperty("name_synonym") List<String> nameSynonym, Language lang) {}

  record Application(String key, List<ApplicationName> names) {}

  List<Application> availableApplications() throws CapabilityException;

  /** Key of the application in the foreground. */
  String currentApplication() throws CapabilityException;

  void installByKey(String key) throws CapabilityException;

  void installByName(String name) throws CapabilityException;

  void searchByKey(String key) throws CapabilityException;

  void searchByName(String name) throws CapabilityException;

  void selectByKey(String key) throws CapabilityException;

  void selectByName(String name) throws CapabilityException;
}
