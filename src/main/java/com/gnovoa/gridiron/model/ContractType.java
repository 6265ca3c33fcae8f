package com.gnovoa.gridiron.model;

public enum ContractType {
  ROOKIE,
  VETERAN,
  MINIMUM
}
