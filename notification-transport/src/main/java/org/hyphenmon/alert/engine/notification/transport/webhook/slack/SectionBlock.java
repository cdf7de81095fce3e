package org.hyphenmon.alert.engine.notification.transport.webhook.slack;

public class SectionBlock implements Block {
  public static final String TYPE = BlockType.SECTION.name().toLowerCase();
  private Text text;

  public static SectionBlock withText(Text text) {
    SectionBlock block = new SectionBlock();
    block.setText(text);
    return block;
  }

  @Override
  public String getType() {
    return TYPE;
  }

  public Text getText() {
    return text;
  }

  public void setText(Text text) {
    this.text = text;
  }
}
