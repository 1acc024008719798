package com.ospicorp.costforecast.forecast.model;

public enum Milestone {
  END_OF_THIS_MONTH("end_of_this_month"),
  END_OF_NEXT_MONTH("end_of_next_month"),
  END_OF_NEXT_QUARTER("end_of_next_quarter"),
  END_OF_FOLLOWING_QUARTER("end_of_following_quarter"),
  END_OF_YEAR("end_of_year");

  private final String label;

  Milestone(String label) {
    this.label = label;
  }

  public String label() {
    return label;
  }
}
